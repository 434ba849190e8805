package com.shoplens.backend.validation;

import lombok.Value;

@Value
public class MissingItem {
    String field;
    String checklistItemId;
}
