/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.ad.model;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
