package com.seveninterprise.stackforge.model;

/**
 * Stack template: a directory holding a docker-compose.yml and, optionally,
 * a .env with default variables for every instance
 *
 * @author levi
 */
public class Template {

    private String name;
    private String description;
    private String version;
    private String path;
    private boolean envFile;

    public Template() {}

    public Template(String name, String description, String version, String path) {
        this(name, description, version, path, false);
    }

    public Template(String name, String description, String version, String path, boolean envFile) {
        this.name = name;
        this.description = description;
        this.version = version;
        this.path = path;
        this.envFile = envFile;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Derived from the directory name ("webserver-php" becomes "webserver php")
     */
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Trailing x.y.z of the directory name, 1.0.0 when absent
     */
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isEnvFile() {
        return envFile;
    }

    public void setEnvFile(boolean envFile) {
        this.envFile = envFile;
    }

    @Override
    public String toString() {
        return "Template{name='" + name + "', version='" + version + "', envFile=" + envFile + "}";
    }
}
