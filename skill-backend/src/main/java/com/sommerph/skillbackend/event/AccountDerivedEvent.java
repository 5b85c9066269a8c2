package com.sommerph.skillbackend.event;

import com.sommerph.skillbackend.model.account.BoundAccount;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AccountDerivedEvent {

    private BoundAccount account;

}
