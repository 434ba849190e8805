package com.shoplens.backend.job.output;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.model.enums.StageName;
import lombok.Value;

@Value
public class CrawlOutput implements StageOutput {
    HarvestedData data;

    @Override
    public StageName getStage() {
        return StageName.CRAWLING;
    }
}
