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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Buffers key presses and resolves them against bound multi-key sequences (chords).
 *
 * <p>Resolution of each {@link #press(String) press}:</p>
 * <ol>
 *   <li>The key is appended to the pending buffer.</li>
 *   <li>If the buffer equals a bound source exactly, the target is returned and the buffer is
 *       cleared. This check comes first, so with {@code "a b"} and {@code "a b c"} both bound the
 *       longer chord can never be reached.</li>
 *   <li>Otherwise, if the buffer is a strict prefix of some bound source, it is kept and the
 *       press reports that a chord is continuing.</li>
 *   <li>Otherwise the buffer is dropped. Only the current key is reported as unhandled; the
 *       earlier buffered keys are not replayed.</li>
 * </ol>
 *
 * <p>Example:</p>
 * <pre>{@code
 * ChordRemapper remapper = new ChordRemapper();
 * remapper.bind(KeySequence.of("Z", "Z"), KeySequence.of("q"));
 * remapper.press("Z");   // Pending(continuing=true)
 * remapper.press("Z");   // Matched(q)
 * }</pre>
 *
 * <p>Not thread-safe; owned by the control loop.</p>
 */
public class ChordRemapper {

    private static final Logger logger = LogManager.getLogger(ChordRemapper.class);

    private final Map<KeySequence, KeySequence> mapping = new LinkedHashMap<>();
    private KeySequence pending = KeySequence.EMPTY;

    /**
     * Binds {@code source} to {@code target}, replacing any earlier binding of {@code source}.
     *
     * @throws IllegalStateException    if a chord is partially typed
     * @throws IllegalArgumentException if {@code source} is empty
     */
    public void bind(KeySequence source, KeySequence target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        checkNotPending("bind");
        if (source.isEmpty()) {
            throw new IllegalArgumentException("Cannot bind an empty key sequence");
        }
        KeySequence previous = mapping.put(source, target);
        if (previous != null) {
            logger.debug("Rebound chord [{}] from [{}] to [{}]", source, previous, target);
        } else {
            logger.debug("Bound chord [{}] to [{}]", source, target);
        }
    }

    /**
     * Removes the binding of {@code source}, if any.
     *
     * @throws IllegalStateException if a chord is partially typed
     */
    public void unbind(KeySequence source) {
        checkNotPending("unbind");
        if (mapping.remove(source) != null) {
            logger.debug("Unbound chord [{}]", source);
        }
    }

    /**
     * Feeds one key press through the chord buffer.
     *
     * @param key the pressed key
     * @return the match target, or whether a chord is still being typed
     */
    public PressResult press(String key) {
        KeySequence current = pending.append(key);
        pending = KeySequence.EMPTY;

        KeySequence target = mapping.get(current);
        if (target != null) {
            logger.trace("Chord [{}] matched, dispatching [{}]", current, target);
            return PressResult.matched(target);
        }

        for (KeySequence source : mapping.keySet()) {
            if (current.isStrictPrefixOf(source)) {
                pending = current;
                return PressResult.pending(true);
            }
        }
        if (current.size() > 1) {
            logger.trace("Dropped partial chord [{}]", current);
        }
        return PressResult.pending(false);
    }

    /**
     * Drops any partially typed chord.
     */
    public void reset() {
        pending = KeySequence.EMPTY;
    }

    /**
     * @return the keys buffered for an unfinished chord
     */
    public KeySequence getPending() {
        return pending;
    }

    /**
     * @return a snapshot of all bindings, in bind order
     */
    public Map<KeySequence, KeySequence> getBindings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    private void checkNotPending(String operation) {
        if (!pending.isEmpty()) {
            throw new IllegalStateException("Cannot " + operation + " while chord [" + pending + "] is pending");
        }
    }
}
