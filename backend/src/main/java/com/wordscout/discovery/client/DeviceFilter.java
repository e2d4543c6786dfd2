package com.wordscout.discovery.client;

public enum DeviceFilter {
    ALL("DEVICE_ALL"),
    DESKTOP("DEVICE_DESKTOP"),
    PHONE("DEVICE_PHONE"),
    TABLET("DEVICE_TABLET");

    private final String apiValue;

    DeviceFilter(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }
}
