package com.roomhub.roomservice.engine.core;

/**
 * 大厅里可开房的游戏种类。
 * maxPlayers 决定房间注册表最多发放多少个玩家槽位（P1..Pn）。
 */
public enum GameType {
    /** 井字棋：两人 */
    TIC_TAC_TOE("tictactoe", 2),
    /** 跳棋：两人，第二人加入时开局 */
    CHECKERS("checkers", 2),
    /** 21点：最多 4 个座位 */
    BLACKJACK("blackjack", 4);

    private final String key;
    private final int maxPlayers;

    GameType(String key, int maxPlayers) {
        this.key = key;
        this.maxPlayers = maxPlayers;
    }

    /** 传输层使用的小写名称（Envelope.game） */
    public String key() {
        return key;
    }

    public int maxPlayers() {
        return maxPlayers;
    }

    /**
     * 宽松解析：大小写不敏感，接受枚举名或 key。
     * @throws IllegalArgumentException 未知游戏
     */
    public static GameType parse(String raw) {
        if (raw != null) {
            String s = raw.trim();
            for (GameType t : values()) {
                if (t.name().equalsIgnoreCase(s) || t.key.equalsIgnoreCase(s)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("UNKNOWN_GAME_TYPE: " + raw);
    }
}
