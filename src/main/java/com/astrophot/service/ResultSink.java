package com.astrophot.service;

import com.astrophot.model.SessionReport;

import java.io.IOException;

public interface ResultSink {

    void accept(SessionReport report) throws IOException;
}
