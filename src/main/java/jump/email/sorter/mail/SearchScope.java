package jump.email.sorter.mail;

public enum SearchScope {
    ALL,
    UNSEEN
}
