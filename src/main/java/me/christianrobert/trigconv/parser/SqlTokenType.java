package me.christianrobert.trigconv.parser;

public enum SqlTokenType {
    WORD,
    NUMBER,
    STRING,
    QUOTED_IDENTIFIER,
    SYMBOL
}
