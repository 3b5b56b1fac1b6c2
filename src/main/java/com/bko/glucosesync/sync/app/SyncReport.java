package com.bko.glucosesync.sync.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SyncReport {
    private final List<String> messages = new ArrayList<>();
    private boolean success = true;
    private boolean skipped;
    private boolean officialAttempted;
    private boolean shareAttempted;
    private boolean officialSucceeded;
    private boolean shareSucceeded;
    private int officialSaved;
    private int shareSaved;

    public void info(String message) {
        messages.add(message);
    }

    public void warn(String message) {
        messages.add("WARN: " + message);
    }

    public void error(String message) {
        messages.add("ERROR: " + message);
        success = false;
    }

    public void skip(String reason) {
        messages.add("SKIPPED: " + reason);
        skipped = true;
    }

    public void merge(SyncReport other) {
        if (other == null) {
            return;
        }
        messages.addAll(other.messages);
        success = success && other.success;
        skipped = skipped && other.skipped;
        officialAttempted = officialAttempted || other.officialAttempted;
        shareAttempted = shareAttempted || other.shareAttempted;
        officialSucceeded = officialSucceeded || other.officialSucceeded;
        shareSucceeded = shareSucceeded || other.shareSucceeded;
        officialSaved += other.officialSaved;
        shareSaved += other.shareSaved;
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public boolean isOfficialAttempted() {
        return officialAttempted;
    }

    public void setOfficialAttempted(boolean officialAttempted) {
        this.officialAttempted = officialAttempted;
    }

    public boolean isShareAttempted() {
        return shareAttempted;
    }

    public void setShareAttempted(boolean shareAttempted) {
        this.shareAttempted = shareAttempted;
    }

    public boolean isOfficialSucceeded() {
        return officialSucceeded;
    }

    public void setOfficialSucceeded(boolean officialSucceeded) {
        this.officialSucceeded = officialSucceeded;
    }

    public boolean isShareSucceeded() {
        return shareSucceeded;
    }

    public void setShareSucceeded(boolean shareSucceeded) {
        this.shareSucceeded = shareSucceeded;
    }

    public boolean isAnySucceeded() {
        return officialSucceeded || shareSucceeded;
    }

    public int getOfficialSaved() {
        return officialSaved;
    }

    public void addOfficialSaved(int count) {
        this.officialSaved += count;
    }

    public int getShareSaved() {
        return shareSaved;
    }

    public void addShareSaved(int count) {
        this.shareSaved += count;
    }
}
