package com.questrail.plcbridge.support;

import com.questrail.plcbridge.api.Metric;
import com.questrail.plcbridge.api.MetricValue;
import com.questrail.plcbridge.api.PublisherUnavailableException;
import com.questrail.plcbridge.api.TelemetryPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Publisher double that records every accepted call and can be switched to
 * refuse publications.
 */
public final class RecordingTelemetryPublisher implements TelemetryPublisher {

    public record SchemaCall(String scope, List<Metric> metrics) {
        public Optional<Metric> metric(String name) {
            return metrics.stream().filter(m -> m.name().equals(name)).findFirst();
        }
    }

    public record ValuesCall(String scope, List<MetricValue> values) {}

    private final List<SchemaCall> schemas = new ArrayList<>();
    private final List<ValuesCall> values = new ArrayList<>();
    private volatile boolean unavailable;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public synchronized void publishSchema(String scope, List<Metric> metrics) {
        if (unavailable) {
            throw new PublisherUnavailableException("not connected");
        }
        schemas.add(new SchemaCall(scope, List.copyOf(metrics)));
    }

    @Override
    public synchronized void publishValues(String scope, List<MetricValue> metrics) {
        if (unavailable) {
            throw new PublisherUnavailableException("not connected");
        }
        values.add(new ValuesCall(scope, List.copyOf(metrics)));
    }

    public synchronized List<SchemaCall> schemaCalls() {
        return new ArrayList<>(schemas);
    }

    public synchronized List<ValuesCall> valueCalls() {
        return new ArrayList<>(values);
    }

    public synchronized SchemaCall lastSchema() {
        if (schemas.isEmpty()) {
            throw new AssertionError("no schema announced");
        }
        return schemas.get(schemas.size() - 1);
    }

    /**
     * Every published value, flattened across calls, in order.
     */
    public synchronized List<MetricValue> publishedValues() {
        List<MetricValue> all = new ArrayList<>();
        values.forEach(call -> all.addAll(call.values()));
        return all;
    }

    public synchronized void clear() {
        schemas.clear();
        values.clear();
    }
}
