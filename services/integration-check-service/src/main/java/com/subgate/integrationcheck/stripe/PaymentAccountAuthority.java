package com.subgate.integrationcheck.stripe;

/**
 * Payment processor that resolves a secret key to the account it belongs to. A refused key is an
 * {@link AccountLookup} with an error; an unreachable processor throws {@link
 * com.subgate.integrationcheck.common.error.AuthorityUnreachableException}.
 */
public interface PaymentAccountAuthority {

  AccountLookup fetchAccount(String secretKey);
}
