package com.logwatch.anomaly.model;

public record BaselineKey(String service, Metric metric, int hourOfDay, int dayOfWeek) {

    public String asRecordKey() {
        return service + "|" + metric.name() + "|" + hourOfDay + "|" + dayOfWeek;
    }
}
