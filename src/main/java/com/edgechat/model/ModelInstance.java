package com.edgechat.model;

/**
 * Backend state attached to an initialized {@link Model}. Exactly one of the two backends owns a
 * model at a time.
 */
public sealed interface ModelInstance permits TaskModelInstance, GenieModelInstance {
}
