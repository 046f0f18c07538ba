package com.example.regreport.util;

import com.example.regreport.model.AccountBalance;
import com.example.regreport.model.Holding;
import com.example.regreport.model.InvestmentPosition;
import com.example.regreport.model.LedgerEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Utility class for deriving composite classification keys from fact rows
 * The same field order is used on the fact side and in the mapping tables
 */
@Component
public class KeyBuilder {

    /**
     * Concatenate the string form of each field, in order, and strip the result
     * Example: ("1200", "BOND", "HTM") -> "1200BONDHTM"
     */
    public String compose(List<?> fields) {
        StringBuilder key = new StringBuilder();
        for (Object field : fields) {
            key.append(asText(field));
        }
        return key.toString().strip();
    }

    public String compose(Object... fields) {
        return compose(Arrays.asList(fields));
    }

    /**
     * Key into the transaction-type mapping: group account + security type + investments
     */
    public String transactionTypeKey(LedgerEntry entry) {
        return compose(entry.groupAccount(), entry.securityType(), entry.investments());
    }

    /**
     * Key into the investment-type mapping: security type + LT/ST flag
     */
    public String investmentTypeKey(LedgerEntry entry) {
        return compose(entry.securityType(), entry.ltSt());
    }

    public String investmentTypeKey(Holding holding) {
        return compose(holding.securityType(), holding.ltSt());
    }

    /**
     * Key into the investment mapping: security id + security type
     */
    public String investmentKey(LedgerEntry entry) {
        return compose(entry.securityId(), entry.securityType());
    }

    public String investmentKey(Holding holding) {
        return compose(holding.securityId(), holding.securityType());
    }

    /**
     * Key into the account mapping: account no + secondary no + name
     */
    public String accountKey(AccountBalance account) {
        return compose(account.accountNo(), account.accountNo2(), account.accountName());
    }

    /**
     * Key into the position mapping: security id + investment type + LT/ST flag
     */
    public String positionKey(InvestmentPosition position) {
        return compose(position.securityId(), position.investmentType(), position.ltSt());
    }

    private String asText(Object field) {
        if (field == null) {
            return "";
        }
        if (field instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return field.toString();
    }
}
