package com.mergington.highschool.model;

public enum TeacherRole {
    TEACHER,
    ADMIN
}
