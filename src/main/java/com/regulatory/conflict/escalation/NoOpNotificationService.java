package com.regulatory.conflict.escalation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification service that only logs. Used when no delivery channel is configured.
 */
public class NoOpNotificationService implements NotificationService {
    private static final Logger log = LoggerFactory.getLogger(NoOpNotificationService.class);

    @Override
    public void notify(String stakeholderRef, EscalationCase escalationCase) {
        log.debug("notification.skipped stakeholder={} caseId={} level={}",
                stakeholderRef, escalationCase.getId(), escalationCase.getLevel());
    }
}
