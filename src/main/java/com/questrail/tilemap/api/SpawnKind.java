package com.questrail.tilemap.api;

public enum SpawnKind
{
    MONSTER,
    NPC
}
