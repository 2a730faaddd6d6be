package com.shepherd.service;

import org.springframework.lang.Nullable;

import java.nio.file.Path;

/** Cursor over one project's conversation log. Owned by a single supervisor. */
public interface LogHandle {

    String projectId();

    /** False while no log exists yet for the project. */
    boolean attached();

    @Nullable
    Path currentFile();
}
