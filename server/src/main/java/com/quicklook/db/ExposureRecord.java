package com.quicklook.db;

public class ExposureRecord {
    private final long id;
    private final String name;
    private final int exposureNumber;
    private final String typicalPath;
    private final long createdTs;

    public ExposureRecord(long id, String name, int exposureNumber, String typicalPath, long createdTs) {
        this.id = id;
        this.name = name;
        this.exposureNumber = exposureNumber;
        this.typicalPath = typicalPath;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getExposureNumber() {
        return exposureNumber;
    }

    public String getTypicalPath() {
        return typicalPath;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "ExposureRecord{id=" + id + ", name='" + name + "'}";
    }
}
