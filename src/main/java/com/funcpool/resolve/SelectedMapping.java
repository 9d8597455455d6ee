package com.funcpool.resolve;

import com.funcpool.storage.LocalizationMapping;
import lombok.Value;

@Value
public class SelectedMapping {
    String language;
    LocalizationMapping mapping;
}
