package com.deepansh.pawsagent.tool;

/**
 * Input type of tools that take no arguments. Any property sent by the model is
 * rejected as unknown.
 */
public final class NoInput {
}
