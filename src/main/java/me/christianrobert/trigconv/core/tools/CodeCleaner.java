package me.christianrobert.trigconv.core.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes PL/SQL comments from source text while keeping every line break,
 * so line numbers computed on the cleaned text match the original.
 * The removed comment texts are collected in encounter order.
 */
public class CodeCleaner {

  public static CleanedCode removeComments(String plsqlCode) {
    StringBuilder result = new StringBuilder(plsqlCode.length());
    List<String> comments = new ArrayList<>();
    StringBuilder comment = null;
    boolean inSingleQuote = false;         // inside a '...' literal
    boolean inDoubleQuote = false;         // inside a "quoted identifier"
    boolean inSingleLineComment = false;   // -- comment
    boolean inMultiLineComment = false;    // /* comment */

    for (int i = 0; i < plsqlCode.length(); i++) {
      char currentChar = plsqlCode.charAt(i);
      char nextChar = (i + 1 < plsqlCode.length()) ? plsqlCode.charAt(i + 1) : '\0';

      if (inSingleLineComment) {
        if (currentChar == '\n') {
          inSingleLineComment = false;
          addComment(comments, comment);
          result.append(currentChar);
        } else if (currentChar != '\r') {
          comment.append(currentChar);
        }
        continue;
      }

      if (inMultiLineComment) {
        if (currentChar == '*' && nextChar == '/') {
          inMultiLineComment = false;
          addComment(comments, comment);
          i++;
        } else {
          comment.append(currentChar);
          if (currentChar == '\n') {
            // keep the line structure of the surrounding code
            result.append('\n');
          }
        }
        continue;
      }

      if (inSingleQuote) {
        result.append(currentChar);
        if (currentChar == '\'') {
          if (nextChar == '\'') {
            result.append(nextChar);
            i++;
          } else {
            inSingleQuote = false;
          }
        }
        continue;
      }

      if (inDoubleQuote) {
        result.append(currentChar);
        if (currentChar == '"') {
          inDoubleQuote = false;
        }
        continue;
      }

      if (currentChar == '-' && nextChar == '-') {
        inSingleLineComment = true;
        comment = new StringBuilder();
        i++;
        continue;
      }

      if (currentChar == '/' && nextChar == '*') {
        inMultiLineComment = true;
        comment = new StringBuilder();
        i++;
        continue;
      }

      if (currentChar == '\'') {
        inSingleQuote = true;
      } else if (currentChar == '"') {
        inDoubleQuote = true;
      }
      result.append(currentChar);
    }

    // Unterminated comment at end of input
    if (inSingleLineComment || inMultiLineComment) {
      addComment(comments, comment);
    }

    return new CleanedCode(result.toString(), comments);
  }

  private static void addComment(List<String> comments, StringBuilder comment) {
    String text = comment.toString().trim();
    if (!text.isEmpty()) {
      comments.add(text);
    }
  }
}
