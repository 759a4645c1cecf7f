/*
 * Copyright Kubestatus Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubestatus.reconcile.check;

import java.util.List;

/**
 * A status which does not follow the condition conventions.
 */
public class StatusConformanceException extends RuntimeException {

    private final transient List<String> violations;

    public StatusConformanceException(List<String> violations) {
        super("Status does not conform: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
