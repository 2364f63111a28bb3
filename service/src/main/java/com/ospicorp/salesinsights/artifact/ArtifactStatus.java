package com.ospicorp.salesinsights.artifact;

public enum ArtifactStatus {
  LOADED,
  MISSING,
  MALFORMED
}
