package com.phillippitts.windowanalysis.service.retry;

/**
 * One attempt at a provider call, returning the raw response text.
 */
@FunctionalInterface
public interface ProviderCall {

    String call() throws Exception;
}
