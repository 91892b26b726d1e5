package com.meshtopo.gateway.mqtt;

/**
 * One message as delivered by the broker.
 *
 * @param topic topic the message was published on
 * @param payload raw message body
 * @param retained broker retain flag
 */
public record InboundPayload(String topic, byte[] payload, boolean retained) {}
