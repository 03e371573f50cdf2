package com.rebenew.pongParty.gameserver.model;

//Estados posibles de una sala de juego. Una sala vacía no existe en el registro.

public enum RoomState {
    WAITING,    // Falta al menos una pala por asignar
    ACTIVE,     // Ambas palas asignadas, loop de ticks corriendo
    TERMINATED  // Sala destruida (sin jugadores)
}
