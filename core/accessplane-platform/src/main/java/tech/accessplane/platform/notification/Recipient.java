package tech.accessplane.platform.notification;

public record Recipient(String email, String firstName, String lastName) {

    public String displayName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        String name = (first + " " + last).trim();
        return name.isEmpty() ? email : name;
    }
}
