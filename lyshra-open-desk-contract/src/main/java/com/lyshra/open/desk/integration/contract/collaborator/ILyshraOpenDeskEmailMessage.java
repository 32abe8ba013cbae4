package com.lyshra.open.desk.integration.contract.collaborator;

import java.util.Optional;

public interface ILyshraOpenDeskEmailMessage {
    String getRecipients();
    Optional<String> getCc();
    Optional<String> getBcc();
    String getSubject();
    String getContent();
}
