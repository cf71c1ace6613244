package com.flamingo.ai.chunker.service.cleansing;

/**
 * One text rewrite applied during cleansing.
 *
 * <p>Rules must be total (defined for every input, including the empty string) and idempotent.
 */
@FunctionalInterface
public interface TextCleansingRule {

  String apply(String text);
}
