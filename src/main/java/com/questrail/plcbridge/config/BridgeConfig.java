package com.questrail.plcbridge.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * BridgeConfig
 * -----------------------------------------------------------------------------
 * Deployment-level configuration for one bridge instance.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>scope</b>: device scope under which every metric is announced and
 *       published (typically the edge node name).</li>
 *   <li><b>templateMode</b>: nested template metrics or flat member metrics
 *       for structured values.</li>
 *   <li><b>rebirthDebounce</b>: quiet period after the last schema change
 *       before the single full re-announcement is sent.</li>
 *   <li><b>ignoredSourceModules</b>: modules whose data events are dropped
 *       unread. The raw scanner feed is ignored by default because the PLC
 *       runtime republishes the processed values with deadbands attached.</li>
 *   <li><b>fallbackCommandModuleId</b>: module that receives commands for
 *       variables the bridge has never seen.</li>
 * </ul>
 */
public record BridgeConfig(
        String scope,
        TemplateMode templateMode,
        Duration rebirthDebounce,
        Set<String> ignoredSourceModules,
        String fallbackCommandModuleId
) {
    public static final Duration DEFAULT_REBIRTH_DEBOUNCE = Duration.ofMillis(500);
    public static final String RAW_SCANNER_MODULE = "ethernetip";

    public BridgeConfig {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(templateMode, "templateMode");
        Objects.requireNonNull(rebirthDebounce, "rebirthDebounce");
        ignoredSourceModules = Set.copyOf(Objects.requireNonNull(ignoredSourceModules, "ignoredSourceModules"));
        Objects.requireNonNull(fallbackCommandModuleId, "fallbackCommandModuleId");

        if (scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        if (rebirthDebounce.isNegative()) {
            throw new IllegalArgumentException("rebirthDebounce must be non-negative");
        }
        if (fallbackCommandModuleId.isBlank()) {
            throw new IllegalArgumentException("fallbackCommandModuleId must not be blank");
        }
    }

    /**
     * Configuration with defaults for everything except the scope.
     */
    public static BridgeConfig defaults(String scope) {
        return builder().withScope(scope).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String scope;
        private TemplateMode templateMode = TemplateMode.FLAT;
        private Duration rebirthDebounce = DEFAULT_REBIRTH_DEBOUNCE;
        private Set<String> ignoredSourceModules = Set.of(RAW_SCANNER_MODULE);
        private String fallbackCommandModuleId = RAW_SCANNER_MODULE;

        public Builder withScope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder withTemplateMode(TemplateMode templateMode) {
            this.templateMode = templateMode;
            return this;
        }

        public Builder withRebirthDebounce(Duration rebirthDebounce) {
            this.rebirthDebounce = rebirthDebounce;
            return this;
        }

        public Builder withIgnoredSourceModules(Set<String> modules) {
            this.ignoredSourceModules = modules;
            return this;
        }

        public Builder withFallbackCommandModuleId(String moduleId) {
            this.fallbackCommandModuleId = moduleId;
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(scope, templateMode, rebirthDebounce, ignoredSourceModules, fallbackCommandModuleId);
        }
    }
}
