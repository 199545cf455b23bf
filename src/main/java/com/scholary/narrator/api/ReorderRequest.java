package com.scholary.narrator.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/** New queue order; must name exactly the currently queued jobs. */
public record ReorderRequest(@NotNull List<String> jobIds) {}
