package com.rewardradar.client;

/**
 * Device ("gizmo") attached to a home, e.g. an EV charger or a home battery.
 */
public record Device(String id, String title, String type, boolean hidden) {
}
