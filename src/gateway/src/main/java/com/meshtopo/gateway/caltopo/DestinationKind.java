package com.meshtopo.gateway.caltopo;

/** The two CalTopo position-report modes. */
public enum DestinationKind {
  CONNECT_KEY("connect_key"),
  GROUP("group");

  private final String label;

  DestinationKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
