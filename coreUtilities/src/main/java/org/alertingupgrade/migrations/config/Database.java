package org.alertingupgrade.migrations.config;

public class Database {
    public String url;
    public String username;
    public String password;
}
