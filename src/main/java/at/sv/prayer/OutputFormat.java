package at.sv.prayer;

public enum OutputFormat {
    TEXT,
    JSON
}
