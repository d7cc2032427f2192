package com.propertyBot.ratingsBot.gateway.util;

/**
 * Utility class for masking chat IDs in logs.
 */
public class ChatIdMasker {

    private ChatIdMasker() {
    }

    /**
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param chatId The chat ID to mask
     * @return Masked chat ID (e.g., "12****34")
     */
    public static String mask(String chatId) {
        if (chatId == null || chatId.length() <= 4) {
            return "****";
        }
        return chatId.substring(0, 2) + "****" + chatId.substring(chatId.length() - 2);
    }
}
