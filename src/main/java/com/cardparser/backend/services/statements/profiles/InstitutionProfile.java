package com.cardparser.backend.services.statements.profiles;

import java.util.List;
import java.util.Map;

import com.cardparser.backend.services.statements.rules.FieldName;
import com.cardparser.backend.services.statements.rules.FieldTrace;

public interface InstitutionProfile {

    String issuerName();

    boolean validate(String text);

    /**
     * One entry per {@link FieldName}; absent fields map to {@code null}.
     */
    Map<FieldName, String> extractAll(String text);

    List<FieldTrace> trace(String text);
}
