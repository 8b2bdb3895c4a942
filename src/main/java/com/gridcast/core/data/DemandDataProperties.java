package com.gridcast.core.data;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

@Component
@ConfigurationProperties(prefix = "gridcast.data")
public class DemandDataProperties {

    private String demandTable = "\"00_RAW\".\"00_IESO_DEMAND\"";
    private String zonalTable = "\"01_PRI\".\"01_IESO_ZONAL_DEMAND\"";
    private String dateColumn = "Date";
    private String hourColumn = "Hour";
    private String ontarioColumn = "Ontario_Demand";
    private String marketColumn = "Market_Demand";
    private String zoneColumn = "Zone";
    private String zonalValueColumn = "Demand";

    /** Market time offset; hour-ending values are converted to interval starts in this offset. */
    private String zoneOffset = "-05:00";

    /** Look-back used by data queries when no explicit dates are given. */
    private int defaultDaysBack = 7;

    /** Look-back used for model training when the caller does not specify one. */
    private int trainingDaysBack = 28;

    /** Maximum number of raw records returned to the reasoning oracle. */
    private int maxRecords = 100;

    public String getDemandTable() {
        return demandTable;
    }

    public void setDemandTable(String demandTable) {
        this.demandTable = demandTable;
    }

    public String getZonalTable() {
        return zonalTable;
    }

    public void setZonalTable(String zonalTable) {
        this.zonalTable = zonalTable;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public String getHourColumn() {
        return hourColumn;
    }

    public void setHourColumn(String hourColumn) {
        this.hourColumn = hourColumn;
    }

    public String getOntarioColumn() {
        return ontarioColumn;
    }

    public void setOntarioColumn(String ontarioColumn) {
        this.ontarioColumn = ontarioColumn;
    }

    public String getMarketColumn() {
        return marketColumn;
    }

    public void setMarketColumn(String marketColumn) {
        this.marketColumn = marketColumn;
    }

    public String getZoneColumn() {
        return zoneColumn;
    }

    public void setZoneColumn(String zoneColumn) {
        this.zoneColumn = zoneColumn;
    }

    public String getZonalValueColumn() {
        return zonalValueColumn;
    }

    public void setZonalValueColumn(String zonalValueColumn) {
        this.zonalValueColumn = zonalValueColumn;
    }

    public String getZoneOffset() {
        return zoneOffset;
    }

    public void setZoneOffset(String zoneOffset) {
        this.zoneOffset = zoneOffset;
    }

    public int getDefaultDaysBack() {
        return defaultDaysBack;
    }

    public void setDefaultDaysBack(int defaultDaysBack) {
        this.defaultDaysBack = defaultDaysBack;
    }

    public int getTrainingDaysBack() {
        return trainingDaysBack;
    }

    public void setTrainingDaysBack(int trainingDaysBack) {
        this.trainingDaysBack = trainingDaysBack;
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public ZoneOffset marketOffset() {
        return ZoneOffset.of(zoneOffset);
    }
}
