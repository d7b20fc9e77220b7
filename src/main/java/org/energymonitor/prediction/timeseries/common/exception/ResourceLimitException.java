/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.common.exception;

import java.util.Locale;

import org.energymonitor.prediction.timeseries.constant.CommonMessages;

/**
 * A request asked for more of a bounded resource than the engine allows.
 */
public class ResourceLimitException extends ClientException {
    private final String resource;
    private final long limit;

    public ResourceLimitException(String resource, long limit) {
        super(String.format(Locale.ROOT, CommonMessages.RESOURCE_LIMIT_MSG, resource, limit));
        this.resource = resource;
        this.limit = limit;
    }

    public String getResource() {
        return resource;
    }

    public long getLimit() {
        return limit;
    }
}
