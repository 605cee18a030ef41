package io.slot4j;

import java.util.List;

/**
 * Source of the rotating accounts of an account group.
 */
public interface AccountDirectory {
    List<String> listActiveAccounts(String groupId);
}
