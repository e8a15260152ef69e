package io.intellixity.vellum.persistence.audit;

public enum AuditOperation { CREATE, READ, UPDATE, DELETE }
