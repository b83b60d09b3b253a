package com.stationsentinel.batch.io;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.stationsentinel.core.model.Metric;

/**
 * Column names of the files read and written by the job.
 */
final class CsvColumns {

    static final String TIMESTAMP = "timestamp";
    static final String STATION_ID = "station_id";
    static final String REGION = "region";
    static final String METRIC = "metric";
    static final String VALUE = "value";

    private CsvColumns() {
        // constants only
    }

    /**
     * @return header schema {@code timestamp, station_id, region,
     *         temperature, humidity, pressure}
     */
    static CsvSchema observationSchema() {
        CsvSchema.Builder builder = CsvSchema.builder()
                .addColumn(TIMESTAMP)
                .addColumn(STATION_ID)
                .addColumn(REGION);
        for (Metric metric : Metric.values()) {
            builder.addColumn(metric.getFieldName(), CsvSchema.ColumnType.NUMBER);
        }
        return builder.build().withHeader();
    }

    /**
     * @return header schema {@code timestamp, station_id, metric, value}
     */
    static CsvSchema groundTruthSchema() {
        return CsvSchema.builder()
                .addColumn(TIMESTAMP)
                .addColumn(STATION_ID)
                .addColumn(METRIC)
                .addColumn(VALUE, CsvSchema.ColumnType.NUMBER)
                .build()
                .withHeader();
    }
}
