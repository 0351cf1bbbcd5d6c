// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.config;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a configuration record with the config path its components are read from, e.g. {@code canary.transport}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE})
public @interface ConfigSection {
    /**
     * @return the path of the section within the loaded configuration
     */
    String value();
}
