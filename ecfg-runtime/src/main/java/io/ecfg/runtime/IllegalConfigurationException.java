/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.runtime;

/**
 * Signals that the configuration is syntactically correct but does not allow the requested operation.
 * For example if no document format was configured and none was given.
 */
public class IllegalConfigurationException extends RuntimeException {
    public IllegalConfigurationException(String message) {
        super(message);
    }
}
