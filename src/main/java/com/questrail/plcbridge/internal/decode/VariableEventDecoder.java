package com.questrail.plcbridge.internal.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent;
import com.questrail.plcbridge.internal.events.VariableUpdateEvent.BatchItem;
import com.questrail.plcbridge.internal.time.WallClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * VariableEventDecoder
 * ============================================================================
 * Converts an inbound JSON data payload into a {@link VariableUpdateEvent}.
 *
 * <h2>Payload shapes</h2>
 * <pre>
 * single: {moduleId, variableId, value, timestamp?, datatype,
 *          deadband?: {value, maxTime?}, disableRBE?, description?,
 *          udtTemplate?: {name, version?, members: [{name, datatype}]}}
 * batch:  {moduleId, deviceId?, timestamp?, values: [{variableId, value, datatype, deadband?}]}
 * </pre>
 * A payload with a {@code values} array is a batch.
 *
 * <h2>Field rules</h2>
 * <ul>
 *   <li>The owning module is the first token of the subject
 *       ({@code moduleId.data.variableId}); the payload's {@code moduleId}
 *       is used only when there is no subject.</li>
 *   <li>An unknown {@code datatype} decodes as {@link VariableKind#TEXT}; a
 *       missing one is inferred from the value.</li>
 *   <li>{@code deadband.maxTime} is in milliseconds; zero or negative means
 *       no staleness bound.</li>
 *   <li>{@code timestamp} is epoch milliseconds; when absent the receive time
 *       is used.</li>
 *   <li>A batch with any invalid item is malformed as a whole.</li>
 * </ul>
 *
 * <h2>What this decoder does NOT do</h2>
 * It does not correct declared kinds against values, apply policies or
 * filter ignored modules. Those belong to the bridge loop.
 *
 * <p>Decoding never throws; failures come back as
 * {@link DecodeResult.Malformed}. Instances are thread-safe.</p>
 */
public final class VariableEventDecoder
{
    private static final String DATA_SEGMENT = ".data.";

    private final ObjectMapper mapper;
    private final WallClock wallClock;

    public VariableEventDecoder(WallClock wallClock) {
        this(new ObjectMapper(), wallClock);
    }

    public VariableEventDecoder(ObjectMapper mapper, WallClock wallClock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public DecodeResult decode(String subject, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return decode(subject, new String(payload, StandardCharsets.UTF_8));
    }

    public DecodeResult decode(String subject, String payload) {
        try {
            JsonNode root = mapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new VariableDecodeException("payload is not a JSON object");
            }
            return new DecodeResult.Decoded(decodeObject(subject, root));
        } catch (JsonProcessingException e) {
            return new DecodeResult.Malformed(subject, "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (VariableDecodeException | IllegalArgumentException e) {
            return new DecodeResult.Malformed(subject, e.getMessage(), e);
        }
    }

    private VariableUpdateEvent decodeObject(String subject, JsonNode root) throws JsonProcessingException {
        String owner = ownerOf(subject, root);
        Instant timestamp = timestampOf(root);

        JsonNode values = root.get("values");
        if (values != null && values.isArray()) {
            return decodeBatch(root, owner, timestamp, values);
        }
        return decodeSingle(subject, root, owner, timestamp);
    }

    private VariableUpdateEvent.SingleUpdate decodeSingle(String subject,
                                                          JsonNode root,
                                                          String owner,
                                                          Instant timestamp) throws JsonProcessingException {
        String variableId = text(root, "variableId");
        if (variableId == null) {
            variableId = variableIdFromSubject(subject, owner);
        }
        if (variableId == null || variableId.isBlank()) {
            throw new VariableDecodeException("missing variableId");
        }

        Object value = valueOf(root, variableId);
        VariableKind kind = kindOf(root, value);

        Optional<Boolean> disabled = Optional.empty();
        JsonNode rbe = root.get("disableRBE");
        if (rbe != null && !rbe.isNull()) {
            if (!rbe.isBoolean()) {
                throw new VariableDecodeException("disableRBE of " + variableId + " is not a boolean");
            }
            disabled = Optional.of(rbe.booleanValue());
        }

        return new VariableUpdateEvent.SingleUpdate(
                timestamp,
                owner,
                variableId,
                kind,
                value,
                deadbandOf(root, variableId),
                disabled,
                Optional.ofNullable(text(root, "description")),
                templateOf(root.get("udtTemplate")));
    }

    private VariableUpdateEvent.BatchUpdate decodeBatch(JsonNode root,
                                                        String owner,
                                                        Instant timestamp,
                                                        JsonNode values) throws JsonProcessingException {
        List<BatchItem> items = new ArrayList<>(values.size());
        int index = 0;
        for (JsonNode item : values) {
            if (!item.isObject()) {
                throw new VariableDecodeException("batch item " + index + " is not an object");
            }
            String variableId = text(item, "variableId");
            if (variableId == null || variableId.isBlank()) {
                throw new VariableDecodeException("batch item " + index + " has no variableId");
            }
            Object value = valueOf(item, variableId);
            items.add(new BatchItem(variableId, kindOf(item, value), value, deadbandOf(item, variableId)));
            index++;
        }
        return new VariableUpdateEvent.BatchUpdate(timestamp, owner, text(root, "deviceId"), items);
    }

    private String ownerOf(String subject, JsonNode root) {
        if (subject != null && !subject.isBlank()) {
            int dot = subject.indexOf('.');
            String first = dot < 0 ? subject : subject.substring(0, dot);
            if (!first.isBlank()) {
                return first;
            }
        }
        String owner = text(root, "moduleId");
        if (owner == null || owner.isBlank()) {
            throw new VariableDecodeException("cannot determine owning module");
        }
        return owner;
    }

    private static String variableIdFromSubject(String subject, String owner) {
        if (subject == null) {
            return null;
        }
        String prefix = owner + DATA_SEGMENT;
        return subject.startsWith(prefix) ? subject.substring(prefix.length()) : null;
    }

    private Instant timestampOf(JsonNode root) {
        JsonNode ts = root.get("timestamp");
        if (ts != null && ts.isNumber()) {
            return Instant.ofEpochMilli(ts.longValue());
        }
        return wallClock.now();
    }

    private Object valueOf(JsonNode node, String variableId) throws JsonProcessingException {
        if (!node.has("value")) {
            throw new VariableDecodeException("missing value for " + variableId);
        }
        JsonNode value = node.get("value");
        if (value.isNull()) {
            return null;
        }
        return mapper.treeToValue(value, Object.class);
    }

    private static VariableKind kindOf(JsonNode node, Object value) {
        String declared = text(node, "datatype");
        if (declared != null) {
            return VariableKind.fromDeclared(declared).orElse(VariableKind.TEXT);
        }
        if (value instanceof Number) {
            return VariableKind.NUMBER;
        }
        if (value instanceof Boolean) {
            return VariableKind.BOOLEAN;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return VariableKind.STRUCTURED;
        }
        return VariableKind.TEXT;
    }

    private static Optional<FilterPolicy> deadbandOf(JsonNode node, String variableId) {
        JsonNode deadband = node.get("deadband");
        if (deadband == null || deadband.isNull()) {
            return Optional.empty();
        }
        if (!deadband.isObject()) {
            throw new VariableDecodeException("deadband of " + variableId + " is not an object");
        }
        JsonNode threshold = deadband.get("value");
        if (threshold == null || !threshold.isNumber()) {
            throw new VariableDecodeException("deadband of " + variableId + " has no numeric value");
        }

        JsonNode maxTime = deadband.get("maxTime");
        if (maxTime != null && maxTime.isNumber() && maxTime.longValue() > 0) {
            return Optional.of(FilterPolicy.deadband(threshold.doubleValue(), Duration.ofMillis(maxTime.longValue())));
        }
        return Optional.of(FilterPolicy.deadband(threshold.doubleValue()));
    }

    private static Optional<StructureTemplate> templateOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isObject()) {
            throw new VariableDecodeException("udtTemplate is not an object");
        }
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new VariableDecodeException("udtTemplate has no name");
        }
        JsonNode members = node.get("members");
        if (members == null || !members.isArray()) {
            throw new VariableDecodeException("udtTemplate " + name + " has no members array");
        }

        List<StructureTemplate.Member> list = new ArrayList<>(members.size());
        for (JsonNode member : members) {
            String memberName = text(member, "name");
            if (memberName == null || memberName.isBlank()) {
                throw new VariableDecodeException("udtTemplate " + name + " has an unnamed member");
            }
            VariableKind kind = VariableKind.fromDeclared(text(member, "datatype")).orElse(VariableKind.TEXT);
            list.add(new StructureTemplate.Member(memberName, kind));
        }

        String version = text(node, "version");
        return Optional.of(new StructureTemplate(name, version == null ? "" : version, list));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : null;
    }
}
