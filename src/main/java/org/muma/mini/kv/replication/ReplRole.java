package org.muma.mini.kv.replication;

public enum ReplRole {
    MASTER("master"),
    REPLICA("replica");

    // INFO 里展示的名字
    private final String infoName;

    ReplRole(String infoName) {
        this.infoName = infoName;
    }

    public String infoName() {
        return infoName;
    }
}
