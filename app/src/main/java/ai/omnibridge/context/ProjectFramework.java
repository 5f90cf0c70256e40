package ai.omnibridge.context;

import ai.omnibridge.session.IProject;

/** A project paired with its active build target. */
public record ProjectFramework(IProject project, String framework) {}
