package com.parallel.wordflux;

/**
 * One entry of a ranking: a token and how often it occurred.
 */
public record WordCount(String word, long count) {
}
