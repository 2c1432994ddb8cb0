package com.my.ingest.domain.port.out;

import com.my.ingest.domain.model.PollingError;

@FunctionalInterface
public interface PollingErrorListener {
    void onError(PollingError error);
}
