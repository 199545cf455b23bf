package com.scholary.narrator.api;

import com.scholary.narrator.service.MetadataUpdate;
import jakarta.validation.constraints.Size;
import java.util.List;

public record MetadataUpdateRequest(
    @Size(max = 200) String customName,
    @Size(max = 5000) String note,
    List<String> tags,
    Boolean published) {

  public MetadataUpdate toUpdate() {
    return new MetadataUpdate(customName, note, tags, published);
  }
}
