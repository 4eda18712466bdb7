package com.sandy.aiot.warning.vo;

/** Projection of a due notification entry, selected before it is claimed. */
public record DueNotification(Long id, Long warningId, int level) {}
