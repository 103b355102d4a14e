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

package io.rcpanel.supervisor;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of a {@link ProcessSupervisor}. The defaults run {@code rclone rcd}
 * and wait for its remote control notice.
 *
 * <pre>{@code
 * SupervisorConfig config = SupervisorConfig.builder()
 *     .withBinaryName("rclone")
 *     .withBinaryPath(Path.of("/opt/rclone/rclone"))
 *     .build();
 * }</pre>
 */
public final class SupervisorConfig {

    public static final String DEFAULT_BINARY_NAME = "rclone";
    public static final List<String> DEFAULT_ARGUMENTS = List.of("rcd");
    public static final String DEFAULT_READINESS_MARKER = " NOTICE: Serving remote control on ";

    private final String binaryName;
    private final List<String> arguments;
    private final String readinessMarker;
    private final Path binaryPath;

    private SupervisorConfig(Builder builder) {
        this.binaryName = builder.binaryName;
        this.arguments = List.copyOf(builder.arguments);
        this.readinessMarker = builder.readinessMarker;
        this.binaryPath = builder.binaryPath;
    }

    public static SupervisorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the executable name looked up on the search path
     */
    public String getBinaryName() {
        return binaryName;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /**
     * @return the substring expected in the helper's first diagnostic line
     */
    public String getReadinessMarker() {
        return readinessMarker;
    }

    /**
     * @return an explicitly configured binary, which bypasses discovery
     */
    public Optional<Path> getBinaryPath() {
        return Optional.ofNullable(binaryPath);
    }

    @Override
    public String toString() {
        return "SupervisorConfig{binary=" + (binaryPath != null ? binaryPath : binaryName)
                + ", arguments=" + arguments + "}";
    }

    public static class Builder {
        private String binaryName = DEFAULT_BINARY_NAME;
        private List<String> arguments = DEFAULT_ARGUMENTS;
        private String readinessMarker = DEFAULT_READINESS_MARKER;
        private Path binaryPath;

        public Builder withBinaryName(String binaryName) {
            if (binaryName == null || binaryName.isBlank()) {
                throw new IllegalArgumentException("Binary name must not be blank");
            }
            this.binaryName = binaryName;
            return this;
        }

        public Builder withArguments(List<String> arguments) {
            this.arguments = Objects.requireNonNull(arguments, "arguments");
            return this;
        }

        public Builder withReadinessMarker(String readinessMarker) {
            if (readinessMarker == null || readinessMarker.isEmpty()) {
                throw new IllegalArgumentException("Readiness marker must not be empty");
            }
            this.readinessMarker = readinessMarker;
            return this;
        }

        /**
         * Pre-resolves the binary so that discovery never runs.
         *
         * @param binaryPath the executable, or null to discover it
         */
        public Builder withBinaryPath(Path binaryPath) {
            this.binaryPath = binaryPath;
            return this;
        }

        public SupervisorConfig build() {
            return new SupervisorConfig(this);
        }
    }
}
