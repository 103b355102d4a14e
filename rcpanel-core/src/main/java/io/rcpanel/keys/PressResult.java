/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rcpanel.keys;

import java.util.Objects;

/**
 * Outcome of {@link ChordRemapper#press(String)}.
 *
 * <ul>
 *   <li><strong>matched:</strong> the buffered keys formed a bound chord; {@link #getTarget()}
 *       holds the keys to dispatch instead.</li>
 *   <li><strong>pending, continuing:</strong> the buffered keys are a prefix of a bound chord;
 *       the key is swallowed while the chord is completed.</li>
 *   <li><strong>pending, not continuing:</strong> no chord can match; the buffer was dropped and
 *       the current key should fall through to the default bindings.</li>
 * </ul>
 */
public final class PressResult {

    private static final PressResult CONTINUING = new PressResult(null, true);
    private static final PressResult FALLTHROUGH = new PressResult(null, false);

    private final KeySequence target;
    private final boolean continuing;

    private PressResult(KeySequence target, boolean continuing) {
        this.target = target;
        this.continuing = continuing;
    }

    public static PressResult matched(KeySequence target) {
        return new PressResult(Objects.requireNonNull(target, "target"), false);
    }

    public static PressResult pending(boolean continuing) {
        return continuing ? CONTINUING : FALLTHROUGH;
    }

    public boolean isMatched() {
        return target != null;
    }

    /**
     * @return the mapped-to keys
     * @throws IllegalStateException if this result is not a match
     */
    public KeySequence getTarget() {
        if (target == null) {
            throw new IllegalStateException("No target for a pending result");
        }
        return target;
    }

    /**
     * @return true when a chord is still being typed; always false for a match
     */
    public boolean isContinuing() {
        return continuing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PressResult)) {
            return false;
        }
        PressResult that = (PressResult) o;
        return continuing == that.continuing && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, continuing);
    }

    @Override
    public String toString() {
        return isMatched() ? "Matched(" + target + ")" : "Pending(continuing=" + continuing + ")";
    }
}
