package com.my.callsync.domain.service;

import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.ContactStage;
import com.my.callsync.domain.model.NewContact;
import com.my.callsync.domain.port.out.ContactDirectoryPort;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

class InMemoryContactDirectory implements ContactDirectoryPort {

    private final Map<String, Contact> contacts = new LinkedHashMap<>();
    private final Set<String> failingEmails = new HashSet<>();
    private int sequence;

    Contact add(String userId, String name, String email, String firm, ContactStage stage) {
        Contact contact = new Contact("contact-" + (++sequence), userId, name, email, firm, null, stage);
        contacts.put(contact.id(), contact);
        return contact;
    }

    void failCreationFor(String email) {
        failingEmails.add(email.toLowerCase(Locale.ROOT));
    }

    List<Contact> all() {
        return new ArrayList<>(contacts.values());
    }

    Contact get(String contactId) {
        return contacts.get(contactId);
    }

    @Override
    public Optional<Contact> findByEmail(String userId, String email) {
        return contacts.values().stream()
                .filter(contact -> contact.userId().equals(userId))
                .filter(contact -> contact.email() != null && contact.email().equalsIgnoreCase(email))
                .findFirst();
    }

    @Override
    public Optional<Contact> findById(String userId, String contactId) {
        return Optional.ofNullable(contacts.get(contactId)).filter(contact -> contact.userId().equals(userId));
    }

    @Override
    public Contact create(String userId, NewContact contact) {
        if (failingEmails.contains(contact.email())) {
            throw new IllegalStateException("연락처 생성 실패: " + contact.email());
        }
        return add(userId, contact.name(), contact.email(), contact.firm(), contact.stage());
    }

    @Override
    public boolean advanceStage(String userId, String contactId, ContactStage target) {
        Contact current = contacts.get(contactId);
        if (current == null || !current.stage().precedes(target)) {
            return false;
        }
        contacts.put(contactId, new Contact(current.id(), current.userId(), current.name(), current.email(),
                current.firm(), current.position(), target));
        return true;
    }
}
