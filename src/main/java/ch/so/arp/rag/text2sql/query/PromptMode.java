package ch.so.arp.rag.text2sql.query;

public enum PromptMode {
    INITIAL,
    REPAIR
}
