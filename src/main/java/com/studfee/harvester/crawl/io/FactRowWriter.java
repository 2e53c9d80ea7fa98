package com.studfee.harvester.crawl.io;

import com.studfee.harvester.crawl.model.FactRow;

import java.util.List;

public interface FactRowWriter {
    void write(List<FactRow> rows);
}
