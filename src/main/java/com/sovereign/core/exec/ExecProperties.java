package com.sovereign.core.exec;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sovereign.exec")
public class ExecProperties {

    /** Shell used to run action command lines with {@code -c}. */
    private String shell = "/bin/sh";

    /** Per-action timeout; 0 or less disables it. */
    private int timeoutSeconds = 300;

    /** Working directory when the task context carries no repository path. */
    private String workingDirectory = ".";

    public String getShell() { return shell; }
    public void setShell(String shell) { this.shell = shell; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
}
