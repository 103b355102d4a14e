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

package io.rcpanel.control;

/**
 * One stage of the key input pipeline. The first stage that consumes a key ends its dispatch.
 */
@FunctionalInterface
public interface KeyStage {

    /**
     * @param key the key name
     * @return true if the key was consumed
     */
    boolean onKey(String key);
}
