package com.herzen.dropout.view;

/** ADMIN sees the teacher report. */
public enum UserRole {
    STUDENT,
    TEACHER,
    ADMIN;

    public boolean seesTeacherReport() {
        return this != STUDENT;
    }
}
