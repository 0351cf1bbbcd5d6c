// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.http;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Creates connection managers.
 */
@FunctionalInterface
public interface ConnectionManagerFactory {
    /**
     * @param options the settings of the new manager
     * @return a new connection manager
     */
    @NonNull
    ConnectionManager create(@NonNull ConnectionManagerOptions options);
}
