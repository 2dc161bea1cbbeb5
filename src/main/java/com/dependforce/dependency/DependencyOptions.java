package com.dependforce.dependency;

/**
 * Options for one dependency analysis run.
 */
public class DependencyOptions {
    private boolean allowSystemObjects = false;
    private DependencyDirection direction = DependencyDirection.DEPENDENTS;
    private boolean includeSelf = false;
    private boolean includeScript = true;

    public boolean isAllowSystemObjects() { return allowSystemObjects; }
    public void setAllowSystemObjects(boolean allow) { this.allowSystemObjects = allow; }

    public DependencyDirection getDirection() { return direction; }
    public void setDirection(DependencyDirection direction) {
        this.direction = direction != null ? direction : DependencyDirection.DEPENDENTS;
    }

    public boolean isIncludeSelf() { return includeSelf; }
    public void setIncludeSelf(boolean include) { this.includeSelf = include; }

    public boolean isIncludeScript() { return includeScript; }
    public void setIncludeScript(boolean include) { this.includeScript = include; }

    @Override
    public String toString() {
        return String.format("direction=%s, includeSelf=%s, includeScript=%s, allowSystemObjects=%s",
            direction, includeSelf, includeScript, allowSystemObjects);
    }
}
