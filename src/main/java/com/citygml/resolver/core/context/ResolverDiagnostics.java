package com.citygml.resolver.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/infos) accumulated while loading reference data.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ResolverDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasErrors() {
	  return !this.errors.isEmpty();
  }

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

}
