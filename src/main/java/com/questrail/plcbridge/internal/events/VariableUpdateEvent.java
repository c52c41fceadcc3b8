package com.questrail.plcbridge.internal.events;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * VariableUpdateEvent
 * -----------------------------------------------------------------------------
 * Data events published by upstream control modules.
 *
 * <p>A module either reports one variable with its full metadata
 * ({@link SingleUpdate}) or several variables at once with a reduced set of
 * fields ({@link BatchUpdate}).</p>
 */
public sealed interface VariableUpdateEvent extends BridgeEvent
        permits VariableUpdateEvent.SingleUpdate, VariableUpdateEvent.BatchUpdate
{
    String ownerModuleId();

    /**
     * One variable, optionally with a structure template, a filter-disable
     * flag and a description.
     */
    final class SingleUpdate extends BridgeEvent.Base implements VariableUpdateEvent {
        private final String ownerModuleId;
        private final String variableId;
        private final VariableKind declaredKind;
        private final Object value;
        private final Optional<FilterPolicy> policy;
        private final Optional<Boolean> filterDisabled;
        private final Optional<String> description;
        private final Optional<StructureTemplate> template;

        public SingleUpdate(Instant timestamp,
                            String ownerModuleId,
                            String variableId,
                            VariableKind declaredKind,
                            Object value,
                            Optional<FilterPolicy> policy,
                            Optional<Boolean> filterDisabled,
                            Optional<String> description,
                            Optional<StructureTemplate> template) {
            super(timestamp);
            this.ownerModuleId = Objects.requireNonNull(ownerModuleId, "ownerModuleId");
            this.variableId = Objects.requireNonNull(variableId, "variableId");
            this.declaredKind = Objects.requireNonNull(declaredKind, "declaredKind");
            this.value = value;
            this.policy = Objects.requireNonNull(policy, "policy");
            this.filterDisabled = Objects.requireNonNull(filterDisabled, "filterDisabled");
            this.description = Objects.requireNonNull(description, "description");
            this.template = Objects.requireNonNull(template, "template");
        }

        /**
         * Minimal update with no policy, flag, description or template.
         */
        public static SingleUpdate of(Instant timestamp,
                                      String ownerModuleId,
                                      String variableId,
                                      VariableKind declaredKind,
                                      Object value) {
            return new SingleUpdate(timestamp, ownerModuleId, variableId, declaredKind, value,
                    Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
        }

        public SingleUpdate withPolicy(FilterPolicy p) {
            return new SingleUpdate(timestamp(), ownerModuleId, variableId, declaredKind, value,
                    Optional.of(p), filterDisabled, description, template);
        }

        public SingleUpdate withTemplate(StructureTemplate t) {
            return new SingleUpdate(timestamp(), ownerModuleId, variableId, declaredKind, value,
                    policy, filterDisabled, description, Optional.of(t));
        }

        public SingleUpdate withFilterDisabled(boolean disabled) {
            return new SingleUpdate(timestamp(), ownerModuleId, variableId, declaredKind, value,
                    policy, Optional.of(disabled), description, template);
        }

        @Override
        public String ownerModuleId() {
            return ownerModuleId;
        }

        public String variableId() {
            return variableId;
        }

        public VariableKind declaredKind() {
            return declaredKind;
        }

        public Object value() {
            return value;
        }

        public Optional<FilterPolicy> policy() {
            return policy;
        }

        public Optional<Boolean> filterDisabled() {
            return filterDisabled;
        }

        public Optional<String> description() {
            return description;
        }

        public Optional<StructureTemplate> template() {
            return template;
        }

        @Override
        public String toString() {
            return "SingleUpdate[" + ownerModuleId + "/" + variableId + " " + declaredKind + " = " + value + "]";
        }
    }

    /**
     * Several variables reported together. Items carry no template,
     * description or filter-disable flag.
     */
    final class BatchUpdate extends BridgeEvent.Base implements VariableUpdateEvent {
        private final String ownerModuleId;
        private final String deviceId;
        private final List<BatchItem> items;

        public BatchUpdate(Instant timestamp, String ownerModuleId, String deviceId, List<BatchItem> items) {
            super(timestamp);
            this.ownerModuleId = Objects.requireNonNull(ownerModuleId, "ownerModuleId");
            this.deviceId = deviceId;
            this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        }

        @Override
        public String ownerModuleId() {
            return ownerModuleId;
        }

        /**
         * Device the module reported for, if any. Informational; every bridge
         * instance publishes under its own configured scope.
         */
        public Optional<String> deviceId() {
            return Optional.ofNullable(deviceId);
        }

        public List<BatchItem> items() {
            return items;
        }

        @Override
        public String toString() {
            return "BatchUpdate[" + ownerModuleId + " x" + items.size() + "]";
        }
    }

    record BatchItem(String variableId, VariableKind declaredKind, Object value, Optional<FilterPolicy> policy)
    {
        public BatchItem {
            Objects.requireNonNull(variableId, "variableId");
            Objects.requireNonNull(declaredKind, "declaredKind");
            Objects.requireNonNull(policy, "policy");
        }
    }
}
