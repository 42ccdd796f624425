package io.mnet.model;

/**
 * Independent markers carried by every packet.
 *
 * <p>{@code fragmentCount} is {@code null} for an unfragmented payload, {@code 0} for a
 * fragment with more to follow, and the total number of fragments on the terminal one.
 */
public record PacketFlags(boolean syn, boolean requiresAck, boolean ack, Integer fragmentCount) {
    public static final PacketFlags NONE = new PacketFlags(false, false, false, null);
    public static final PacketFlags ACK = new PacketFlags(false, false, true, null);

    public PacketFlags {
        if (fragmentCount != null && fragmentCount < 0) {
            throw new IllegalArgumentException("Fragment count must not be negative: " + fragmentCount);
        }
    }

    public static PacketFlags data(boolean requiresAck) {
        return new PacketFlags(false, requiresAck, false, null);
    }

    public static PacketFlags fragment(boolean requiresAck, int index, int total) {
        return new PacketFlags(false, requiresAck, false, index < total ? 0 : total);
    }

    public PacketFlags withSyn() {
        return syn ? this : new PacketFlags(true, requiresAck, ack, fragmentCount);
    }

    /**
     * Acks travel on the reliable stream even though they do not ask for one back.
     */
    public boolean reliable() {
        return requiresAck || ack;
    }

    public boolean fragmented() {
        return fragmentCount != null;
    }

    public boolean moreFragments() {
        return fragmentCount != null && fragmentCount == 0;
    }

    public boolean terminalFragment() {
        return fragmentCount != null && fragmentCount > 0;
    }

    /**
     * Wire form: letter-number pairs such as {@code s1r1f3}.
     */
    public String toToken() {
        StringBuilder sb = new StringBuilder(8);
        if (syn) {
            sb.append("s1");
        }
        if (requiresAck) {
            sb.append("r1");
        }
        if (ack) {
            sb.append("a1");
        }
        if (fragmentCount != null) {
            sb.append('f').append(fragmentCount);
        }
        return sb.toString();
    }

    public static PacketFlags parse(String token) {
        if (token == null || token.isEmpty()) {
            return NONE;
        }
        boolean syn = false;
        boolean requiresAck = false;
        boolean ack = false;
        Integer fragmentCount = null;
        int i = 0;
        while (i < token.length()) {
            char letter = token.charAt(i++);
            int start = i;
            while (i < token.length() && Character.isDigit(token.charAt(i))) {
                i++;
            }
            if (start == i || !Character.isLetter(letter)) {
                throw new IllegalArgumentException("Malformed flags token: " + token);
            }
            int value;
            try {
                value = Integer.parseInt(token.substring(start, i));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed flags token: " + token, e);
            }
            switch (letter) {
                case 's' -> syn = value != 0;
                case 'r' -> requiresAck = value != 0;
                case 'a' -> ack = value != 0;
                case 'f' -> fragmentCount = value;
                default -> {
                    // Unknown markers from newer peers.
                }
            }
        }
        return new PacketFlags(syn, requiresAck, ack, fragmentCount);
    }

    @Override
    public String toString() {
        return toToken();
    }
}
