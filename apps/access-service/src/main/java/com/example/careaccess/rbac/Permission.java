package com.example.careaccess.rbac;

public enum Permission {
    ACCESS_OWN_DATA,
    ACCESS_OTHERS_DATA,
    ACCESS_ASSIGNED_PATIENTS,
    ACCESS_FAMILY_MEMBER_DATA,

    MODIFY_SYSTEM_SETTINGS,
    VIEW_AUDIT_LOGS,
    MANAGE_USERS,
    VIEW_SYSTEM_STATS,

    ESCALATE_CRISIS,
    ACCESS_EMERGENCY_DATA,
    OVERRIDE_CONSENT,

    MANAGE_BILLING,
    PROCESS_PAYMENTS,
    VIEW_FINANCIAL_REPORTS,
    MANAGE_SUBSCRIPTIONS,

    COORDINATE_CARE,
    MANAGE_TREATMENT_PLANS,
    VIEW_CARE_NOTES,
    EDIT_CARE_NOTES,

    SEND_SYSTEM_MESSAGES,
    ACCESS_CHAT_HISTORY,
    MODERATE_CONTENT
}
