package com.flagship.missed_call.pipeline;

/**
 * Produces the text of the automated SMS. Implementations may call out to a
 * text-generation service and may fail; a failure aborts the pipeline before
 * anything is sent.
 */
public interface ResponseGenerator {

    String generate(ResponseRequest request);
}
