package com.gomflow.smartagent.vision;

import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.SubmissionContext;

/**
 * What the vision model is asked to focus on. Every task asks for the same JSON answer so
 * the response parser does not depend on the task.
 */
public record ExtractionTaskHint(TaskType type, String expectedCurrency) {

    public enum TaskType {
        PAYMENT_ANALYSIS,
        AMOUNT,
        METHOD,
        REFERENCE
    }

    private static final String PAYMENT_ANALYSIS_PROMPT = """
            You are an expert at analyzing payment screenshots from Southeast Asian mobile payment apps and banking systems.

            Analyze this payment screenshot and extract the following information:
            - Payment method (GCash, PayMaya, Maya, BPI, Maybank, CIMB, Touch 'n Go, etc.)
            - Amount paid (look for currency symbols ₱ for PHP or RM for MYR)
            - Sender information (name, phone number)
            - Recipient information (name, phone number)
            - Transaction ID or reference number
            - Timestamp of payment
            - Bank or service name

            Be especially careful about:
            1. Distinguishing between sender and recipient
            2. Identifying the correct amount (not fees or balances)
            3. Reading phone numbers correctly (09XXXXXXXXX for PH, 01XXXXXXXX for MY)
            4. Finding transaction references that buyers would use to prove payment
            """;

    private static final String AMOUNT_PROMPT = """
            Extract the monetary amounts from this payment screenshot. Look for the main payment amount,
            fees or charges, balance amounts and any other monetary values.
            Report the actual payment amount sent, not account balances or fees.
            Currency symbols: ₱ for Philippines Peso, RM for Malaysian Ringgit.
            """;

    private static final String METHOD_PROMPT = """
            Identify the payment method used in this screenshot. Common methods include:
            Philippines: GCash, PayMaya/Maya, GrabPay, BPI, BDO, Metrobank, UnionBank
            Malaysia: Maybank2u, CIMB, Touch 'n Go, Boost, GrabPay, Public Bank, Hong Leong Bank
            """;

    private static final String REFERENCE_PROMPT = """
            Extract transaction reference numbers, IDs, or confirmation codes from this payment screenshot.
            Look for the transaction ID, reference number, confirmation code, receipt number or any
            alphanumeric code that proves this transaction.
            """;

    private static final String RESPONSE_FORMAT = """

            Respond in JSON format with this structure:
            {
              "paymentMethod": "string",
              "amount": number,
              "currency": "PHP" or "MYR",
              "senderInfo": "string",
              "recipientInfo": "string",
              "transactionId": "string",
              "timestamp": "string",
              "bankName": "string",
              "referenceNumber": "string",
              "confidence": number (0-1),
              "reasoning": "explanation of what you found"
            }
            Use null for anything you cannot read.
            """;

    public static ExtractionTaskHint paymentAnalysis() {
        return new ExtractionTaskHint(TaskType.PAYMENT_ANALYSIS, null);
    }

    public static ExtractionTaskHint forJob(ProcessingJob job) {
        String currency = job.context().map(SubmissionContext::currency).orElse(null);
        return new ExtractionTaskHint(TaskType.PAYMENT_ANALYSIS, currency);
    }

    public String prompt() {
        StringBuilder prompt = new StringBuilder(basePrompt());
        if (expectedCurrency != null && !expectedCurrency.isBlank()) {
            prompt.append("\nThe payer was expected to pay in ").append(expectedCurrency)
                    .append("; report the currency actually shown.\n");
        }
        prompt.append(RESPONSE_FORMAT);
        return prompt.toString();
    }

    private String basePrompt() {
        switch (type) {
            case AMOUNT:
                return AMOUNT_PROMPT;
            case METHOD:
                return METHOD_PROMPT;
            case REFERENCE:
                return REFERENCE_PROMPT;
            case PAYMENT_ANALYSIS:
            default:
                return PAYMENT_ANALYSIS_PROMPT;
        }
    }
}
