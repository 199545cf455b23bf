package com.scholary.narrator.service;

import java.util.List;

/** User-editable job fields; a null field is left unchanged. */
public record MetadataUpdate(
    String customName, String note, List<String> tags, Boolean published) {}
