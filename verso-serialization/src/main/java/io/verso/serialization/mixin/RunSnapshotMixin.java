package io.verso.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin for {@link io.verso.core.storage.RunSnapshot}.
///
/// Drops the derived `suspended` and `finished` flags, which Jackson would otherwise
/// pick up from the `is*` accessors, so the document only holds record components.
///
/// @see io.verso.serialization.VersoJacksonModule
@JsonIgnoreProperties(value = {"suspended", "finished"}, ignoreUnknown = true)
public abstract class RunSnapshotMixin {}
