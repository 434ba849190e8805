package com.shoplens.backend.job;

import com.shoplens.backend.model.enums.StageName;
import lombok.Value;

@Value
public class JobProgress {
    StageName stage;
    int percentage;
}
