package com.meshtopo.gateway.identity;

/** How much is known about a numeric sender id. States only ever move forward. */
public enum IdentityState {
  UNKNOWN,
  HARDWARE_ID_KNOWN,
  CALLSIGN_KNOWN
}
