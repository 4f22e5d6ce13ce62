package com.my.callsync.domain.port.in;

import com.my.callsync.domain.model.ConfirmResult;
import com.my.callsync.domain.model.ConfirmedAttendee;

import java.util.List;

public interface ConfirmPendingContactsUseCase {
    ConfirmResult confirm(String userId, List<ConfirmedAttendee> approved);
}
