package me.christianrobert.trigconv.core.tools;

import java.util.Collections;
import java.util.List;

/**
 * Source text with comments removed, plus the removed comment texts.
 */
public class CleanedCode {

  private final String code;
  private final List<String> comments;

  public CleanedCode(String code, List<String> comments) {
    this.code = code;
    this.comments = Collections.unmodifiableList(comments);
  }

  public String getCode() {
    return code;
  }

  public List<String> getComments() {
    return comments;
  }
}
