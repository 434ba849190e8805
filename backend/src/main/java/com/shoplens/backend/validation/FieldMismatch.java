package com.shoplens.backend.validation;

import lombok.Value;

@Value
public class FieldMismatch {
    String field;
    Object crawlerValue;
    Object reportValue;
}
