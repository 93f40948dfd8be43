package com.leadflow.backend.services.notification;

public record NotificationContent(String title, String body) {
}
