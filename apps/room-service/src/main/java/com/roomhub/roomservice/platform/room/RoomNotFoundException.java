package com.roomhub.roomservice.platform.room;

/** 房间不存在（已销毁或房间码错误） */
public class RoomNotFoundException extends RuntimeException {

    private final String roomCode;

    public RoomNotFoundException(String roomCode) {
        super("ROOM_NOT_FOUND: " + roomCode);
        this.roomCode = roomCode;
    }

    public String getRoomCode() {
        return roomCode;
    }
}
