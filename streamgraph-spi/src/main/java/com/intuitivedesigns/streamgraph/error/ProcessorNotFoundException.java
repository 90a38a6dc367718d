/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

import java.util.Set;

public class ProcessorNotFoundException extends StreamGraphException {

    public ProcessorNotFoundException(String name, Set<String> available) {
        super("No processor registered as '" + name + "'. Available options: " + available);
    }
}
