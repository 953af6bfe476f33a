// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.abi;

import java.util.Objects;

/**
 * One input of an event.
 *
 * @param name    parameter name; empty when unnamed
 * @param type    canonical Solidity type, tuples already expanded (e.g. {@code (uint256,address)[]})
 * @param indexed whether the value is carried in a topic rather than in the data
 */
public record EventParameter(String name, String type, boolean indexed) {

    public EventParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
    }
}
