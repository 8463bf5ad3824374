package com.tagstore.query;

/**
 * Node of a boolean condition tree
 */
public interface Expression {
}
