package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.Finding;

import java.nio.file.Path;

public interface FindingSink {

    /** Creates the output files if needed. Safe to call more than once. */
    void initialize();

    // write failures are logged, not thrown
    void append(Finding finding);

    Path jsonlPath();

    Path csvPath();
}
