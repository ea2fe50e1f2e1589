/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

/**
 * Executes a synthesized request against an API server. Connection handling, authentication,
 * retries and response decoding are the transport's business.
 *
 * @param <R> the response type
 */
@FunctionalInterface
public interface RequestTransport<R> {

    /**
     * @param request the request
     * @return the response
     */
    R execute(RequestSpec request);
}
